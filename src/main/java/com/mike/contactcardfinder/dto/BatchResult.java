package com.mike.contactcardfinder.dto;

import lombok.Value;

import java.util.List;

@Value
public class BatchResult {
    int batchNumber;
    List<EmailRecord> records;

    public int total() {
        return records.size();
    }

    public int successful() {
        return count(Status.SUCCESS);
    }

    public int notFound() {
        return count(Status.NOT_FOUND);
    }

    public int errors() {
        return count(Status.ERROR);
    }

    /** records left PENDING because a stop was requested mid-batch */
    public int unprocessed() {
        return count(Status.PENDING);
    }

    private int count(Status status) {
        return (int) records.stream().filter(r -> r.getStatus() == status).count();
    }
}
