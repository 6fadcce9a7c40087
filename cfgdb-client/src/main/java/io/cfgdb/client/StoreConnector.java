package io.cfgdb.client;

@FunctionalInterface
public interface StoreConnector {

    StoreConnection connect(DatabaseSpec database);
}
