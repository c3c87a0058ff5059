package com.linlay.deltastream.metrics;

import java.util.Arrays;

public final class RollingWindow {

    private final double[] samples;
    private int head;
    private int size;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.samples = new double[capacity];
    }

    public void add(double sample) {
        samples[head] = sample;
        head = (head + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return samples.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        head = 0;
        size = 0;
    }

    public double sum() {
        double total = 0;
        for (int i = 0; i < size; i++) {
            total += samples[i];
        }
        return total;
    }

    public double average() {
        return size == 0 ? 0 : sum() / size;
    }

    public double[] toArray() {
        double[] copy = new double[size];
        int start = size < samples.length ? 0 : head;
        for (int i = 0; i < size; i++) {
            copy[i] = samples[(start + i) % samples.length];
        }
        return copy;
    }

    public double[] sortedCopy() {
        double[] copy = toArray();
        Arrays.sort(copy);
        return copy;
    }
}
