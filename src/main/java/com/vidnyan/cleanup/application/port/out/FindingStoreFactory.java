package com.vidnyan.cleanup.application.port.out;

/**
 * Creates finding stores from configured connection URLs.
 */
public interface FindingStoreFactory {

    FindingStore create(String name, String url);
}
