package org.salesintel.models.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "field_mapping_set", schema = "integration",
        uniqueConstraints = @UniqueConstraint(name = "uq_field_mapping_set_key",
                columnNames = {"source_system", "entity_type"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(exclude = "entries")
public class FieldMappingSetRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "field_mapping_set_id", nullable = false)
    @EqualsAndHashCode.Include
    private Long id;

    @Column(name = "field_mapping_set_uid", nullable = false, length = 40)
    private String fieldMappingSetUid;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_system", nullable = false, length = 30)
    private SourceSystem sourceSystem;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 30)
    private EntityType entityType;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "entries", nullable = false)
    private List<FieldMapping> entries = new ArrayList<>();

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @ColumnDefault("now()")
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
