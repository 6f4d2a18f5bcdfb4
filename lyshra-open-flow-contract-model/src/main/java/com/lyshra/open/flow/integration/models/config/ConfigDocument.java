package com.lyshra.open.flow.integration.models.config;

import com.lyshra.open.flow.integration.contract.definition.IConfigDocument;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.io.Serializable;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class ConfigDocument implements IConfigDocument, Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String name;
    private final String selector;
    @Singular("entry")
    private final Map<String, Object> data;
}
