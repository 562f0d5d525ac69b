package com.fastbatch.model.enums;

/**
 * 单次派发的结果
 */
public enum AttemptOutcome { SUCCESS, FAILURE, TIMEOUT }
