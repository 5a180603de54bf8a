package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "import_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false, length = 50)
    private String source;

    @Column(name = "file_name")
    private String fileName;

    @Column(name = "records_total")
    private Integer recordsTotal;

    @Column(name = "records_succeeded")
    private Integer recordsSucceeded;

    @Column(name = "records_failed")
    private Integer recordsFailed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
