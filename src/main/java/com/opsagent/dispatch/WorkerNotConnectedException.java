package com.opsagent.dispatch;

public class WorkerNotConnectedException extends DispatchException {

    public WorkerNotConnectedException() {
        super("agent worker not connected");
    }
}
