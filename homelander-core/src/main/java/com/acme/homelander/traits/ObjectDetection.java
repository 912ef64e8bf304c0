package com.acme.homelander.traits;

/**
 * Doorbells and cameras that announce detected objects. Detection is pushed as notifications, so
 * the capability has no attributes, state or commands; registering it only advertises the trait
 * in SYNC.
 */
public interface ObjectDetection {}
