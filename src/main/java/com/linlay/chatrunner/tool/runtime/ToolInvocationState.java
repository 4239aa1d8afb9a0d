package com.linlay.chatrunner.tool.runtime;

public enum ToolInvocationState {

    REQUESTED,
    EXECUTING,
    COMPLETED,
    FAILED
}
