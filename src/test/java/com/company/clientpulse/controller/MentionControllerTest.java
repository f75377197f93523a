package com.company.clientpulse.controller;

import com.company.clientpulse.domain.ClientMention;
import com.company.clientpulse.exception.GlobalExceptionHandler;
import com.company.clientpulse.exception.MentionNotFoundException;
import com.company.clientpulse.service.MentionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MentionControllerTest {

    @Mock
    private MentionService mentionService;

    private MockMvc mockMvc;

    private final ClientMention geth = ClientMention.builder()
            .network("devnet-7")
            .client("geth")
            .mentions(List.of("@geth-team", "@oncall"))
            .enabled(true)
            .build();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MentionController(mentionService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should add mentions and return the client's entry")
    void shouldAdd() throws Exception {
        when(mentionService.add("devnet-7", "geth", List.of("@geth-team", "@oncall"))).thenReturn(geth);

        mockMvc.perform(post("/api/v1/mentions/devnet-7/geth")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mentions\":[\"@geth-team\",\"@oncall\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.mentions[1]").value("@oncall"));
    }

    @Test
    @DisplayName("Should return 400 for an empty mention list")
    void shouldRejectEmptyMentions() throws Exception {
        mockMvc.perform(post("/api/v1/mentions/devnet-7/geth")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mentions\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.mentions").value("At least one mention is required"));

        verifyNoInteractions(mentionService);
    }

    @Test
    @DisplayName("Should remove the mentions given as query parameters")
    void shouldRemove() throws Exception {
        when(mentionService.remove("devnet-7", "geth", List.of("@oncall"))).thenReturn(geth);

        mockMvc.perform(delete("/api/v1/mentions/devnet-7/geth/entries").param("mention", "@oncall"))
                .andExpect(status().isOk());

        verify(mentionService).remove("devnet-7", "geth", List.of("@oncall"));
    }

    @Test
    @DisplayName("Should toggle mentions")
    void shouldDisable() throws Exception {
        ClientMention disabled = ClientMention.builder().network("devnet-7").client("geth").enabled(false).build();
        when(mentionService.setEnabled("devnet-7", "geth", false)).thenReturn(disabled);

        mockMvc.perform(put("/api/v1/mentions/devnet-7/geth/enabled").param("value", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    @DisplayName("Should list mentions for a network")
    void shouldList() throws Exception {
        when(mentionService.list("devnet-7")).thenReturn(List.of(geth));

        mockMvc.perform(get("/api/v1/mentions").param("network", "devnet-7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].client").value("geth"));
    }

    @Test
    @DisplayName("Should return 404 for a client without mentions")
    void shouldReturnNotFound() throws Exception {
        when(mentionService.get("devnet-7", "teku")).thenThrow(new MentionNotFoundException("devnet-7", "teku"));

        mockMvc.perform(get("/api/v1/mentions/devnet-7/teku"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should return 204 after deleting and 404 when nothing was there")
    void shouldPurge() throws Exception {
        mockMvc.perform(delete("/api/v1/mentions/devnet-7/geth"))
                .andExpect(status().isNoContent());
        verify(mentionService).purge("devnet-7", "geth");

        doThrow(new MentionNotFoundException("devnet-7", "teku")).when(mentionService).purge("devnet-7", "teku");
        mockMvc.perform(delete("/api/v1/mentions/devnet-7/teku"))
                .andExpect(status().isNotFound());
    }
}
