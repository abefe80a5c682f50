package com.launchbot.hft.launchpad.execution;

import java.util.concurrent.CompletableFuture;

/**
 * Transaction construction, signing and broadcast live behind this boundary.
 *
 * <p>Network-class failures complete the future with {@link TransientSubmissionException} and are retried;
 * any other exceptional completion or a non-filled result is final.
 */
public interface ExecutionGateway {

    CompletableFuture<SubmissionResult> submit(OrderRequest request);
}
