package com.github.ytdle.model;

import lombok.Value;

/**
 * Answer of a bulk control operation.
 */
@Value
public class ControlResponse {
    String operation;
    int affected;
}
