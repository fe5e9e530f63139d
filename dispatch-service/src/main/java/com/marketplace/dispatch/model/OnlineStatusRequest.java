package com.marketplace.dispatch.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class OnlineStatusRequest {

    @NotNull
    private Boolean online;
}
