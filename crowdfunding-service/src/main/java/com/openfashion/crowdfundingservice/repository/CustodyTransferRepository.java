package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.CustodyTransfer;
import com.openfashion.crowdfundingservice.model.TransferDirection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CustodyTransferRepository extends JpaRepository<CustodyTransfer, UUID> {

    List<CustodyTransfer> findAllByCounterpartyAndDirection(String counterparty, TransferDirection direction);
}
