package com.omega.hoa.model;

import lombok.Value;

@Value
public class ToolInfo {
    String name;
    /** May be null. */
    String version;
}
