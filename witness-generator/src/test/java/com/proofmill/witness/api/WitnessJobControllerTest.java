package com.proofmill.witness.api;

import com.proofmill.witness.model.*;
import com.proofmill.witness.service.WitnessJobQueue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for WitnessJobController. The ledger is a mock.
 */
@WebMvcTest(WitnessJobController.class)
class WitnessJobControllerTest {

    @Autowired MockMvc               mockMvc;
    @MockitoBean WitnessJobQueue     queue;

    // ------------------------------------------------------------------
    // GET /witness-jobs/{round}/{l1BatchNumber}
    // ------------------------------------------------------------------

    @Test
    void getJob_existing_returns200() throws Exception {
        WitnessJob job = new WitnessJob(42, AggregationRound.SCHEDULER);
        job.setStatus(WitnessJobStatus.FAILED);
        job.setErrorKind(FailureKind.INPUT_CONTRACT_VIOLATION);
        job.setErrorMessage("slot 1 holds a base layer proof");
        when(queue.findJob(42, AggregationRound.SCHEDULER)).thenReturn(Optional.of(job));

        mockMvc.perform(get("/witness-jobs/{round}/{batch}", "SCHEDULER", 42))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.l1BatchNumber").value(42))
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.errorKind").value("INPUT_CONTRACT_VIOLATION"));
    }

    @Test
    void getJob_unknown_returns404() throws Exception {
        when(queue.findJob(7, AggregationRound.SCHEDULER)).thenReturn(Optional.empty());

        mockMvc.perform(get("/witness-jobs/{round}/{batch}", "SCHEDULER", 7))
                .andExpect(status().isNotFound());
    }

    @Test
    void getJob_unknownRound_returns400() throws Exception {
        mockMvc.perform(get("/witness-jobs/{round}/{batch}", "FINAL", 7))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /witness-jobs/{round}/{l1BatchNumber}/dependencies
    // ------------------------------------------------------------------

    @Test
    void getDependencies_listsSlotsWithUpstreamStatus() throws Exception {
        when(queue.findJob(42, AggregationRound.SCHEDULER))
                .thenReturn(Optional.of(new WitnessJob(42, AggregationRound.SCHEDULER)));
        when(queue.dependencies(42, AggregationRound.SCHEDULER)).thenReturn(List.of(
                new WitnessJobDependency(42, AggregationRound.SCHEDULER, 1, 10L),
                new WitnessJobDependency(42, AggregationRound.SCHEDULER, 2, null)));
        when(queue.proverJobs(anyList())).thenReturn(List.of(nodeProof(10L, ProverJobStatus.SUCCESSFUL)));

        mockMvc.perform(get("/witness-jobs/{round}/{batch}/dependencies", "SCHEDULER", 42))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].circuitId").value(1))
                .andExpect(jsonPath("$[0].proverJobId").value(10))
                .andExpect(jsonPath("$[0].proverJobStatus").value("SUCCESSFUL"))
                .andExpect(jsonPath("$[1].circuitId").value(2))
                .andExpect(jsonPath("$[1].proverJobStatus").isEmpty());
    }

    @Test
    void getDependencies_unknownJob_returns404() throws Exception {
        when(queue.findJob(7, AggregationRound.SCHEDULER)).thenReturn(Optional.empty());

        mockMvc.perform(get("/witness-jobs/{round}/{batch}/dependencies", "SCHEDULER", 7))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ProverJob nodeProof(long id, ProverJobStatus status) {
        ProverJob job = new ProverJob(42, 1, AggregationRound.NODE_AGGREGATION, 0, 0, "node.bin", true);
        job.setStatus(status);
        // Reflectively set the id since it's normally set by JPA on persist
        try {
            var f = ProverJob.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
