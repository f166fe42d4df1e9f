package io.bastion.api.status;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
