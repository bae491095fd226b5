package com.flagship.etl_agent.dispatch;

public enum TaskStatus {
    PENDING,
    SUCCESS,
    ERROR
}
