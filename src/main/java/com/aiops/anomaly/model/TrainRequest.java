package com.aiops.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Raw log lines used to refit the outlier model")
public class TrainRequest {

    @Schema(description = "Training logs from one or more services")
    private List<RawLogEntry> logs;
}
