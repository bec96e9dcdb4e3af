package com.contract.resolution.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A contract document filed under one of the six groups.
 * {@code (group, sequence)} is unique within a contract.
 */
public final class Document {
    private final String id;
    private final String contractId;
    private final DocumentGroup group;
    private final int sequence;
    private final DocumentStatus status;
    private final String name;
    private final String originalFilename;
    private final ConditionsType conditionsType;
    private final LocalDate effectiveDate;

    private Document(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.contractId = builder.contractId;
        this.group = builder.group;
        this.sequence = builder.sequence;
        this.status = builder.status != null ? builder.status : DocumentStatus.COMPLETED;
        this.name = builder.name != null ? builder.name : group.getLabel() + " " + sequence;
        this.originalFilename = builder.originalFilename;
        if (builder.conditionsType != null) {
            this.conditionsType = builder.conditionsType;
        } else {
            this.conditionsType = group == DocumentGroup.C
                    ? ConditionsType.fromName(this.name) : ConditionsType.NONE;
        }
        this.effectiveDate = builder.effectiveDate;
    }

    public String getId() {
        return id;
    }

    public String getContractId() {
        return contractId;
    }

    public DocumentGroup getGroup() {
        return group;
    }

    public int getSequence() {
        return sequence;
    }

    public DocumentStatus getStatus() {
        return status;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getOriginalFilename() {
        return Optional.ofNullable(originalFilename);
    }

    public ConditionsType getConditionsType() {
        return conditionsType;
    }

    public Optional<LocalDate> getEffectiveDate() {
        return Optional.ofNullable(effectiveDate);
    }

    public boolean isParticularConditions() {
        return group == DocumentGroup.C && conditionsType == ConditionsType.PARTICULAR;
    }

    public boolean isGeneralConditions() {
        return group == DocumentGroup.C && conditionsType != ConditionsType.PARTICULAR;
    }

    /**
     * Short label used in logs and reports, e.g. {@code D2}.
     */
    public String getCode() {
        return group.name() + sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Document document = (Document) o;
        return Objects.equals(id, document.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Document{" +
                "id='" + id + '\'' +
                ", group=" + group +
                ", sequence=" + sequence +
                ", status=" + status +
                ", name='" + name + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String contractId;
        private DocumentGroup group;
        private int sequence;
        private DocumentStatus status;
        private String name;
        private String originalFilename;
        private ConditionsType conditionsType;
        private LocalDate effectiveDate;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder contractId(String contractId) {
            this.contractId = contractId;
            return this;
        }

        public Builder group(DocumentGroup group) {
            this.group = group;
            return this;
        }

        public Builder sequence(int sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder status(DocumentStatus status) {
            this.status = status;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder originalFilename(String originalFilename) {
            this.originalFilename = originalFilename;
            return this;
        }

        public Builder conditionsType(ConditionsType conditionsType) {
            this.conditionsType = conditionsType;
            return this;
        }

        public Builder effectiveDate(LocalDate effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Document build() {
            Objects.requireNonNull(contractId, "contractId is required");
            Objects.requireNonNull(group, "group is required");
            if (sequence < 1) {
                throw new IllegalArgumentException("sequence must be a positive integer, was " + sequence);
            }
            return new Document(this);
        }
    }
}
