package com.flagship.settlement_engine.swap;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SettlementRecordRepository extends JpaRepository<SettlementRecordEntity, String> {

    List<SettlementRecordEntity> findByInitiatorOrderBySettledAtAsc(String initiator);
}
