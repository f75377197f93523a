package com.company.clientpulse.repository;

import com.company.clientpulse.config.StoreProperties;
import com.company.clientpulse.domain.ClientMention;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MentionsRepositoryTest {

    @Mock
    private S3Client s3Client;

    private ObjectMapper objectMapper;
    private MentionsRepository repository;

    @BeforeEach
    void setUp() {
        StoreProperties properties = new StoreProperties();
        properties.setBucket("pulse-bucket");
        properties.setPrefix("pulse");

        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = new MentionsRepository(
                new S3ObjectStore(s3Client, properties, objectMapper, new SimpleMeterRegistry()));
    }

    private void givenObject(String key, String json) {
        when(s3Client.getObjectAsBytes(argThat((GetObjectRequest request) -> request != null && key.equals(request.key()))))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
                        json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should persist mentions under their network and client")
    void shouldPersist() throws Exception {
        // When
        repository.persist(ClientMention.builder()
                .network("devnet-7")
                .client("geth")
                .mentions(List.of("@geth-team"))
                .enabled(true)
                .build());

        // Then
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(request.capture(), body.capture());

        assertThat(request.getValue().key()).isEqualTo("pulse/networks/devnet-7/mentions/geth.json");
        ClientMention stored = objectMapper.readValue(
                body.getValue().contentStreamProvider().newStream().readAllBytes(), ClientMention.class);
        assertThat(stored.getMentions()).containsExactly("@geth-team");
        assertThat(stored.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should return empty when a client has no mentions")
    void shouldReturnEmptyWhenMissing() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertThat(repository.get("devnet-7", "geth")).isEmpty();
    }

    @Test
    @DisplayName("Should list only mention documents, sorted")
    void shouldListMentions() {
        // Given
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .contents(
                        S3Object.builder().key("pulse/networks/devnet-8/mentions/teku.json").build(),
                        S3Object.builder().key("pulse/networks/devnet-7/mentions/geth.json").build(),
                        S3Object.builder().key("pulse/networks/devnet-7/alerts/geth.json").build(),
                        S3Object.builder().key("pulse/networks/devnet-7/mentions/broken.json").build())
                .isTruncated(false)
                .build());
        givenObject("pulse/networks/devnet-8/mentions/teku.json",
                "{\"network\":\"devnet-8\",\"client\":\"teku\",\"mentions\":[\"@teku\"],\"enabled\":true}");
        givenObject("pulse/networks/devnet-7/mentions/geth.json",
                "{\"network\":\"devnet-7\",\"client\":\"geth\",\"mentions\":[],\"enabled\":false}");
        givenObject("pulse/networks/devnet-7/mentions/broken.json", "{not json");

        // When
        List<ClientMention> mentions = repository.list();

        // Then
        assertThat(mentions).extracting(ClientMention::getClient).containsExactly("geth", "teku");
    }

    @Test
    @DisplayName("Should delete the mention document")
    void shouldPurge() {
        repository.purge("devnet-7", "geth");

        verify(s3Client).deleteObject(argThat((DeleteObjectRequest request) ->
                request.key().equals("pulse/networks/devnet-7/mentions/geth.json")));
    }
}
