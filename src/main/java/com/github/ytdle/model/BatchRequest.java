package com.github.ytdle.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a batch submission.
 */
@Data
@NoArgsConstructor
public class BatchRequest {

    private String batchId;

    @Valid
    @NotEmpty
    private List<DownloadRequest> jobs = new ArrayList<>();
}
