package com.dataplatform.acquisition.controller;

import com.dataplatform.common.model.ProviderAttempt;

import java.util.List;

public record ErrorResponse(
    String                kind,
    String                message,
    List<ProviderAttempt> attempts
) {}
