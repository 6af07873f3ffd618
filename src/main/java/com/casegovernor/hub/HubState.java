package com.casegovernor.hub;

public enum HubState {
    IDLE,
    LOADING,
    PUBLISHED,
    REFRESH_PENDING,
    FAILED,
    TORN_DOWN
}
