package com.casegovernor.consumer;

import com.casegovernor.contract.PageData;

/** Callback of the component a consumer adapter feeds. */
@FunctionalInterface
public interface CaseDataListener {

    void onPageData(PageData pageData);

    default void onError(String caseId, Throwable error) {
    }
}
