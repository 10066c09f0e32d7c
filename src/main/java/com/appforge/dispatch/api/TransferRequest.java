package com.appforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TransferRequest(@JsonProperty("new_owner_entity_id") String newOwnerEntityId) {}
