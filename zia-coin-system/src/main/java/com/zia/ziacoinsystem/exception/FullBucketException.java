package com.zia.ziacoinsystem.exception;

import lombok.Data;

/**
 * Thrown when a k-bucket has no room for a new node
 */
@Data
public class FullBucketException extends Exception {
    private int bucketId;
    public FullBucketException() {
        super("Bucket is full");
    }
    public FullBucketException(int bucketId) {
        super("Bucket " + bucketId + " is full");
        this.bucketId = bucketId;
    }
}
