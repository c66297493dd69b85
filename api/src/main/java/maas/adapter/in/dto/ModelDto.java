package maas.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import maas.core.model.probe.ModelDescriptor;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelDto(String name, String description, String host) {

    public static ModelDto fromModel(ModelDescriptor model) {
        return new ModelDto(model.name(), model.description(), model.host().orElse(null));
    }
}
