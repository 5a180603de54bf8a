package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "dim_clients",
        uniqueConstraints = @UniqueConstraint(name = "uq_dim_clients_account_fbid", columnNames = "account_fbid")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Client implements DimensionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "account_fbid", nullable = false)
    private Long accountFbid;

    @Column(name = "client_name")
    private String clientName;

    @Column(name = "created_date")
    private LocalDateTime createdDate;

    @Override
    public Integer getSurrogateKey() {
        return id;
    }
}
