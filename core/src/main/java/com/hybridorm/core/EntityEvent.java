package com.hybridorm.core;

public record EntityEvent(LifecycleEvent type, Entity entity) {}
