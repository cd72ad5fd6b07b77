package com.rivaflow.backend.modules.glossary.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.glossary.domain.Movement;
import com.rivaflow.backend.modules.glossary.domain.MovementCategory;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MovementResponse(
        Long id,
        String name,
        MovementCategory category,
        String subcategory,
        String description,
        List<String> aliases,
        boolean giApplicable,
        boolean nogiApplicable
) {

    public static MovementResponse from(Movement movement) {
        return new MovementResponse(
                movement.getId(),
                movement.getName(),
                movement.getCategory(),
                movement.getSubcategory(),
                movement.getDescription(),
                List.copyOf(movement.getAliases()),
                movement.isGiApplicable(),
                movement.isNogiApplicable()
        );
    }
}
