package com.arbitration.award.gateway;

public interface DocumentStorage {

    StoredDocument store(byte[] data, StorageRequest request);

    byte[] fetch(String url);
}
