package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.Demographic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface DemographicRepository extends JpaRepository<Demographic, Integer> {

    Optional<Demographic> findByAgeBracketAndGender(String ageBracket, String gender);

    @Modifying
    @Query(value = "INSERT INTO dim_demographics (age_bracket, gender) " +
            "SELECT CAST(:ageBracket AS NVARCHAR(4000)), CAST(:gender AS NVARCHAR(4000)) " +
            "WHERE NOT EXISTS (SELECT 1 FROM dim_demographics WHERE age_bracket = :ageBracket AND gender = :gender)",
            nativeQuery = true)
    int insertIfAbsent(@Param("ageBracket") String ageBracket,
                       @Param("gender") String gender);
}
