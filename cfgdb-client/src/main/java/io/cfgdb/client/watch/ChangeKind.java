package io.cfgdb.client.watch;

/**
 * Whether a changed row still exists when the change is dispatched. Decided by re-checking the key
 * after the event arrived, so a row recreated or deleted in between is misclassified.
 */
public enum ChangeKind {
    SET,
    DELETE
}
