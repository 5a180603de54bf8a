package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.Client;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ClientRepository extends JpaRepository<Client, Integer> {

    Optional<Client> findByAccountFbid(Long accountFbid);

    @Modifying
    @Query(value = "INSERT INTO dim_clients (account_fbid, client_name, created_date) " +
            "SELECT CAST(:accountFbid AS BIGINT), CAST(:clientName AS NVARCHAR(4000)), CURRENT_TIMESTAMP " +
            "WHERE NOT EXISTS (SELECT 1 FROM dim_clients WHERE account_fbid = :accountFbid)",
            nativeQuery = true)
    int insertIfAbsent(@Param("accountFbid") Long accountFbid,
                       @Param("clientName") String clientName);
}
