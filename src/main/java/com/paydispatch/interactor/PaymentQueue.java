package com.paydispatch.interactor;

import com.paydispatch.entity.Payment;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

public final class PaymentQueue {
    private final BlockingQueue<Payment> queue;
    private final int capacity;

    public PaymentQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public boolean offer(Payment payment) {
        return queue.offer(payment);
    }

    public Payment take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public int capacity() {
        return capacity;
    }
}
