package com.launchbot.hft.launchpad.execution;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scripted gateway: answers are consumed in order, then every order fills in full at {@code fillPrice}.
 */
public class MockExecutionGateway implements ExecutionGateway {

    private final Deque<Function<OrderRequest, CompletableFuture<SubmissionResult>>> script = new ArrayDeque<>();
    private final List<OrderRequest> requests = new CopyOnWriteArrayList<>();
    private final BigDecimal fillPrice;
    private final BigDecimal fee;

    public MockExecutionGateway(BigDecimal fillPrice, BigDecimal fee) {
        this.fillPrice = fillPrice;
        this.fee = fee;
    }

    @Override
    public synchronized CompletableFuture<SubmissionResult> submit(OrderRequest request) {
        requests.add(request);
        Function<OrderRequest, CompletableFuture<SubmissionResult>> next = script.pollFirst();
        return next == null ? fill(request) : next.apply(request);
    }

    public synchronized MockExecutionGateway thenFill() {
        script.addLast(this::fill);
        return this;
    }

    public synchronized MockExecutionGateway thenTransientFailure() {
        script.addLast(r -> CompletableFuture.failedFuture(new TransientSubmissionException("rpc unavailable")));
        return this;
    }

    public synchronized MockExecutionGateway thenReject(String error) {
        script.addLast(r -> CompletableFuture.completedFuture(SubmissionResult.rejected(r.clientOrderId(), error)));
        return this;
    }

    public synchronized MockExecutionGateway thenHang() {
        script.addLast(r -> new CompletableFuture<>());
        return this;
    }

    public List<OrderRequest> requests() {
        return List.copyOf(requests);
    }

    private CompletableFuture<SubmissionResult> fill(OrderRequest request) {
        return CompletableFuture.completedFuture(SubmissionResult.filled(
                request.clientOrderId(), request.amount(), fillPrice, fee, "sig-" + request.clientOrderId()));
    }
}
