package com.example.evidenceledger.http;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.requests.LogCustodyEventServiceRequest;
import com.example.evidenceledger.service.ActionRegistry;
import com.example.evidenceledger.service.CustodyService;
import com.example.evidenceledger.service.EvidenceLedgerException;
import com.example.evidenceledger.service.FingerprintUtility;
import com.example.evidenceledger.service.LedgerStore;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = CustodyController.class)
@Import({RequestIdFilter.class, ActionRegistry.class, FingerprintUtility.class})
class CustodyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ActionRegistry actionRegistry;

    @MockBean
    private CustodyService custodyService;

    @MockBean
    private LedgerStore ledgerStore;

    private CustodyEvent event(long index, String action, String handler) {
        return CustodyEvent.builder()
                .evidenceId(1L)
                .eventIndex(index)
                .handler(handler)
                .action(action)
                .actionFingerprint(actionRegistry.actionFingerprint(action))
                .timestamp(1_700_000_000_000L + index)
                .metadataHash(Fingerprint.ZERO)
                .build();
    }

    @Test
    @DisplayName("POST custody event passes action, handler and details to the service")
    void logCustodyEvent() throws Exception {
        when(custodyService.logCustodyEvent(any(LogCustodyEventServiceRequest.class)))
                .thenReturn(event(1L, ActionRegistry.ANALYZED, "lab.tech"));

        mockMvc.perform(MockMvcRequestBuilders.post("/evidence/1/custody-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"ANALYZED\",\"handler\":\"lab.tech\",\"details\":{\"bench\":4}}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.event_index", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.action", equalTo("ANALYZED")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.action_name", equalTo("ANALYZED")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.metadata_hash", equalTo(Fingerprint.ZERO.toHex())));

        ArgumentCaptor<LogCustodyEventServiceRequest> captor =
                ArgumentCaptor.forClass(LogCustodyEventServiceRequest.class);
        verify(custodyService).logCustodyEvent(captor.capture());
        assertEquals(1L, captor.getValue().evidenceId());
        assertEquals("lab.tech", captor.getValue().handler());
        assertEquals(4, captor.getValue().details().get("bench"));
    }

    @Test
    @DisplayName("policy rejection returns 403 with the violation event index")
    void policyRejection() throws Exception {
        when(custodyService.logCustodyEvent(any(LogCustodyEventServiceRequest.class)))
                .thenThrow(EvidenceLedgerException.policyViolation(
                        EvidenceLedgerException.Code.INVALID_CUSTODY_ORDER,
                        "Cannot skip required steps: SEALED", 1L));

        mockMvc.perform(MockMvcRequestBuilders.post("/evidence/1/custody-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"ANALYZED\",\"handler\":\"lab.tech\"}"))
                .andExpect(MockMvcResultMatchers.status().isForbidden())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_CUSTODY_ORDER")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.violation_event_index", equalTo(1)));
    }

    @Test
    @DisplayName("blank handler is rejected before reaching the service")
    void blankHandler() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/evidence/1/custody-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"SEALED\",\"handler\":\" \"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_INPUT")));
    }

    @Test
    @DisplayName("GET custody events lists the log and names ad-hoc actions UNKNOWN")
    void listCustodyEvents() throws Exception {
        when(ledgerStore.getCustodyEvents(1L)).thenReturn(List.of(
                event(0L, ActionRegistry.COLLECTED, "officer"),
                event(1L, "PHOTOGRAPHED", "photographer")));

        mockMvc.perform(MockMvcRequestBuilders.get("/evidence/1/custody-events"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].action_name", equalTo("COLLECTED")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[1].action", equalTo("PHOTOGRAPHED")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[1].action_name", equalTo("UNKNOWN")));
    }

    @Test
    @DisplayName("GET custody event out of range returns 404")
    void custodyEventOutOfRange() throws Exception {
        when(ledgerStore.getCustodyEvent(1L, 5L))
                .thenThrow(EvidenceLedgerException.custodyIndexOutOfBounds(1L, 5L, 2L));

        mockMvc.perform(MockMvcRequestBuilders.get("/evidence/1/custody-events/5"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INDEX_OUT_OF_BOUNDS")));
    }

    @Test
    @DisplayName("DELETE checkout returns 204")
    void releaseCheckout() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.delete("/evidence/1/checkout"))
                .andExpect(MockMvcResultMatchers.status().isNoContent());

        verify(custodyService).releaseCheckout(1L);
    }
}
