package com.storefront.identitysync.adapters.in.rest;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.storefront.identitysync.application.port.in.IdentifyUseCase.IdentifyCommand;

@JsonIgnoreProperties(ignoreUnknown = true)
public class IdentifyRequest {

    @JsonProperty("anonymous_id")
    private String anonymousId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("email")
    private String email;

    @JsonProperty("phone")
    private String phone;

    @JsonProperty("traits")
    private Map<String, Object> traits;

    public IdentifyCommand toCommand(String workspaceId) {
        return new IdentifyCommand(workspaceId, anonymousId, userId, email, phone,
                traits != null ? traits : Map.of());
    }

    public String getAnonymousId() {
        return anonymousId;
    }

    public void setAnonymousId(String anonymousId) {
        this.anonymousId = anonymousId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public Map<String, Object> getTraits() {
        return traits;
    }

    public void setTraits(Map<String, Object> traits) {
        this.traits = traits;
    }
}
