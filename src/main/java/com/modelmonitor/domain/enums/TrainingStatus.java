package com.modelmonitor.domain.enums;

public enum TrainingStatus {
    SUCCESS,
    ERROR
}
