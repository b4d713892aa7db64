package com.scholary.testsuite.api;

import com.scholary.testsuite.storage.StoredResult;
import java.util.List;

/** Stored results of one style, newest first. */
public record TestResultsResponse(List<StoredResult> results) {}
