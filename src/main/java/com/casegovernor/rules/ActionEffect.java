package com.casegovernor.rules;

/** What a matching visibility rule does to its action id. */
public enum ActionEffect {
    SHOW,
    HIDE
}
