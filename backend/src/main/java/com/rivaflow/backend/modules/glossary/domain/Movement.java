package com.rivaflow.backend.modules.glossary.domain;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Glossary entry (position, submission, sweep, ...). Rows are seeded by migration and
 * referenced by stable ids from roll submission tags and techniques.
 */
@Entity
@Table(name = "movement")
public class Movement {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private MovementCategory category;

    @Column(name = "subcategory", length = 64)
    private String subcategory;

    @Column(name = "description")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "aliases", nullable = false, columnDefinition = "jsonb")
    private List<String> aliases = new ArrayList<>();

    @Column(name = "gi_applicable", nullable = false)
    private boolean giApplicable = true;

    @Column(name = "nogi_applicable", nullable = false)
    private boolean nogiApplicable = true;

    protected Movement() {
    }

    public Movement(Long id, String name, MovementCategory category, String subcategory, List<String> aliases) {
        this.id = id;
        this.name = name;
        this.category = category;
        this.subcategory = subcategory;
        this.aliases = aliases == null ? new ArrayList<>() : new ArrayList<>(aliases);
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public MovementCategory getCategory() {
        return category;
    }

    public String getSubcategory() {
        return subcategory;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getAliases() {
        return aliases == null ? List.of() : aliases;
    }

    public boolean isGiApplicable() {
        return giApplicable;
    }

    public boolean isNogiApplicable() {
        return nogiApplicable;
    }

    public boolean isSubmission() {
        return category == MovementCategory.SUBMISSION;
    }
}
