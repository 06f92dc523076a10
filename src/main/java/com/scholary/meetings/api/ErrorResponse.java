package com.scholary.meetings.api;

/** Error body for failures that are not request validation errors. */
public record ErrorResponse(String error) {}
