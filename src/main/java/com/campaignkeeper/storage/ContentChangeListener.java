package com.campaignkeeper.storage;

/**
 * Notified after an entity write has been committed to disk.
 */
public interface ContentChangeListener {

    enum ChangeType { CREATED, UPDATED, DELETED }

    void onContentChanged(String campaignId, String moduleId, String entityId, ChangeType type);
}
