package com.casegovernor.hub;

import com.casegovernor.contract.ContractViolationException;
import com.casegovernor.contract.PageData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** PageData travels on the channel as a JSON string. */
@Component
public class PageDataCodec {

    private final ObjectMapper objectMapper;

    public PageDataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(PageData pageData) {
        try {
            return objectMapper.writeValueAsString(pageData);
        } catch (JsonProcessingException ex) {
            throw new ContractViolationException("page data cannot be serialized: " + ex.getOriginalMessage(), ex);
        }
    }

    public PageData decode(String json) {
        try {
            return objectMapper.readValue(json, PageData.class);
        } catch (JsonProcessingException ex) {
            throw new ContractViolationException("page data cannot be parsed: " + ex.getOriginalMessage(), ex);
        }
    }
}
