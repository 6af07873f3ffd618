package com.casegovernor.contract;

public enum EntityType {
    CASE,
    ACCOUNT,
    CONTACT,
    ASSET,
    TASK,
    WORK_ORDER,
    QUOTE
}
