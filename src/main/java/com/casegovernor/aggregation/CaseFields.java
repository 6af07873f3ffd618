package com.casegovernor.aggregation;

/** Field names of the backing CASE record. */
public final class CaseFields {

    public static final String CASE_NUMBER = "case_number";
    public static final String STATUS = "status";
    public static final String RECORD_TYPE = "record_type";
    public static final String SERVICE_TYPE = "service_type";
    public static final String SUB_TYPE = "sub_type";
    public static final String REASON = "reason";
    public static final String PRIORITY = "priority";
    public static final String CLIENT_ACCOUNT_ID = "client_account_id";
    public static final String LOCATION_ACCOUNT_ID = "location_account_id";
    public static final String VENDOR_ACCOUNT_ID = "vendor_account_id";
    public static final String CONTACT_ID = "contact_id";
    public static final String ASSET_ID = "asset_id";
    public static final String WORK_ORDER_ID = "work_order_id";
    public static final String QUOTE_IDS = "quote_ids";
    public static final String OPEN_TASK_IDS = "open_task_ids";
    public static final String RELATED_CASE_IDS = "related_case_ids";
    public static final String CREATED_AT = "created_at";
    public static final String SERVICE_DATE = "service_date";
    public static final String SLA_DUE_DATE = "sla_due_date";
    public static final String PURCHASE_ORDER_NUMBER = "purchase_order_number";
    public static final String PROFILE_NUMBER = "profile_number";
    public static final String PROJECT_SITE_INFORMATION = "project_site_information";
    public static final String COMPANY_CATEGORY = "company_category";
    public static final String VALUE = "value";
    public static final String RISK_FLAG = "risk_flag";
    public static final String APPROVAL_STATUS = "approval_status";
    public static final String SUBJECT = "subject";
    public static final String DESCRIPTION = "description";

    private CaseFields() {
    }
}
