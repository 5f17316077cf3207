package com.calai.dietworkout.prediction.dto;

/** 400 body：{"error": "Missing parameter: 'age'"} */
public record MissingParameterResponse(String error) {}
