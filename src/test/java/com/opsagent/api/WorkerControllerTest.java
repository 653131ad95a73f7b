package com.opsagent.api;

import com.opsagent.dispatch.ConnectionState;
import com.opsagent.dispatch.IncidentDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkerController.class)
class WorkerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private IncidentDispatcher dispatcher;

    @Test
    void testWorkerStatus() throws Exception {
        when(dispatcher.isWorkerConnected()).thenReturn(true);
        when(dispatcher.workerState()).thenReturn(ConnectionState.READY);

        mockMvc.perform(get("/api/worker/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(true))
                .andExpect(jsonPath("$.state").value("READY"));
    }

    @Test
    void testWorkerDisconnected() throws Exception {
        when(dispatcher.isWorkerConnected()).thenReturn(false);
        when(dispatcher.workerState()).thenReturn(ConnectionState.CLOSED);

        mockMvc.perform(get("/api/worker/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(false));
    }
}
