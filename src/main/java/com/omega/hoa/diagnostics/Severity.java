package com.omega.hoa.diagnostics;

public enum Severity {
    ERROR,
    WARNING
}
