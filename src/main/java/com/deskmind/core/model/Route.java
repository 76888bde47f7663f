package com.deskmind.core.model;

/**
 * Router classification of an incoming request.
 */
public enum Route {
    CONVERSATIONAL,
    TASK
}
