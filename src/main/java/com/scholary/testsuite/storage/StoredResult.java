package com.scholary.testsuite.storage;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/** A persisted bundle together with the result id it is stored under. */
public record StoredResult(String id, @JsonUnwrapped ResultBundle bundle) {}
