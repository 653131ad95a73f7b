package com.opsagent.api;

import com.opsagent.dispatch.ConnectionState;
import com.opsagent.dispatch.IncidentDispatcher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class WorkerController {

    private final IncidentDispatcher dispatcher;

    public WorkerController(IncidentDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/status")
    public WorkerStatusResponse status() {
        return new WorkerStatusResponse(dispatcher.isWorkerConnected(), dispatcher.workerState());
    }

    public record WorkerStatusResponse(boolean connected, ConnectionState state) {}
}
