package com.hybridorm.core;

public enum LifecycleEvent {
    SAVING,
    CREATING,
    CREATED,
    UPDATING,
    UPDATED,
    SAVED,
    DELETED
}
