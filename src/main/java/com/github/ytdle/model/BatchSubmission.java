package com.github.ytdle.model;

import lombok.Value;

import java.util.List;

@Value
public class BatchSubmission {
    String batchId;
    List<String> jobIds;
}
