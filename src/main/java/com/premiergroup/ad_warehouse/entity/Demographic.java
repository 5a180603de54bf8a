package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "dim_demographics",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_dim_demographics_age_bracket_gender",
                columnNames = {"age_bracket", "gender"})
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Demographic implements DimensionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "age_bracket", nullable = false, length = 50)
    private String ageBracket;

    @Column(nullable = false, length = 50)
    private String gender;

    @Override
    public Integer getSurrogateKey() {
        return id;
    }
}
