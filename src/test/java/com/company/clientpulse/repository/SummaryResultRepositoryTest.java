package com.company.clientpulse.repository;

import com.company.clientpulse.config.StoreProperties;
import com.company.clientpulse.domain.SummaryResult;
import com.company.clientpulse.exception.InsufficientHistoryException;
import com.company.clientpulse.exception.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SummaryResultRepositoryTest {

    private static final String PREFIX = "pulse/networks/devnet-7/hive_summary/results/";

    @Mock
    private S3Client s3Client;

    private ObjectMapper objectMapper;
    private SummaryResultRepository repository;

    @BeforeEach
    void setUp() {
        StoreProperties properties = new StoreProperties();
        properties.setBucket("pulse-bucket");
        properties.setPrefix("pulse");

        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = new SummaryResultRepository(
                new S3ObjectStore(s3Client, properties, objectMapper, new SimpleMeterRegistry()));
    }

    private void givenKeys(String... names) {
        ListObjectsV2Response response = ListObjectsV2Response.builder()
                .contents(Arrays.stream(names)
                        .map(name -> S3Object.builder().key(PREFIX + name).build())
                        .toArray(S3Object[]::new))
                .isTruncated(false)
                .build();
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(response);
    }

    private void givenObject(String key, SummaryResult summary) throws Exception {
        when(s3Client.getObjectAsBytes(argThat((GetObjectRequest request) -> request != null && key.equals(request.key()))))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
                        objectMapper.writeValueAsBytes(summary)));
    }

    private static SummaryResult summary(String timestamp, int fails) {
        return SummaryResult.builder()
                .network("devnet-7")
                .timestamp(Instant.parse(timestamp))
                .totalTests(10)
                .totalPasses(10 - fails)
                .totalFails(fails)
                .build();
    }

    @Test
    @DisplayName("Should file the snapshot under its UTC date")
    void shouldStoreUnderDate() throws Exception {
        // When
        repository.storeResult(summary("2025-03-12T22:30:00Z", 2));

        // Then
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(request.capture(), body.capture());

        assertThat(request.getValue().bucket()).isEqualTo("pulse-bucket");
        assertThat(request.getValue().key()).isEqualTo(PREFIX + "2025-03-12.json");
        SummaryResult stored = objectMapper.readValue(
                body.getValue().contentStreamProvider().newStream().readAllBytes(), SummaryResult.class);
        assertThat(stored.getTotalFails()).isEqualTo(2);
    }

    @Nested
    @DisplayName("Previous snapshot")
    class Previous {

        @Test
        @DisplayName("Should return the snapshot before the latest")
        void shouldReturnSecondNewest() throws Exception {
            // Given
            givenKeys("2025-03-10.json", "2025-03-12.json", "2025-03-11.json", "notes.txt");
            givenObject(PREFIX + "2025-03-11.json", summary("2025-03-11T09:00:00Z", 1));

            // When
            SummaryResult previous = repository.getPrevious("devnet-7");

            // Then
            assertThat(previous.getTimestamp()).isEqualTo(Instant.parse("2025-03-11T09:00:00Z"));
        }

        @Test
        @DisplayName("Should refuse to compare with fewer than two snapshots")
        void shouldRequireTwoSnapshots() {
            givenKeys("2025-03-12.json");

            assertThatThrownBy(() -> repository.getPrevious("devnet-7"))
                    .isInstanceOf(InsufficientHistoryException.class)
                    .hasMessageContaining("devnet-7");
        }

        @Test
        @DisplayName("Should fail when the listed snapshot cannot be read")
        void shouldFailOnVanishedObject() {
            // Given
            givenKeys("2025-03-11.json", "2025-03-12.json");
            when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                    .thenThrow(NoSuchKeyException.builder().message("gone").build());

            // When / Then
            assertThatThrownBy(() -> repository.getPrevious("devnet-7"))
                    .isInstanceOf(StoreException.class)
                    .hasMessageContaining("2025-03-11");
        }
    }

    @Test
    @DisplayName("Should list snapshot dates newest first")
    void shouldListDates() {
        givenKeys("2025-03-10.json", "2025-03-12.json", "2025-03-11.json");

        assertThat(repository.listDates("devnet-7")).containsExactly(
                LocalDate.of(2025, 3, 12), LocalDate.of(2025, 3, 11), LocalDate.of(2025, 3, 10));
    }

    @Test
    @DisplayName("Should report no latest snapshot for a new network")
    void shouldHaveNoLatest() {
        givenKeys();

        assertThat(repository.getLatest("devnet-7")).isEmpty();
    }

    @Test
    @DisplayName("Should wrap storage errors")
    void shouldWrapStorageErrors() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(S3Exception.builder().message("Access Denied").statusCode(403).build());

        assertThatThrownBy(() -> repository.listDates("devnet-7"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("S3 list failed for summary");
    }
}
