package com.fastmerge.model.enums;

public enum Severity {
    INFO, WARNING, ERROR, CRITICAL
}
