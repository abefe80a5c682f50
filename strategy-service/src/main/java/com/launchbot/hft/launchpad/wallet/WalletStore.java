package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.Wallet;

import java.util.List;
import java.util.Optional;

/**
 * Durable wallet records. The wallet manager is the only writer.
 */
public interface WalletStore {

    List<Wallet> findAll();

    Optional<Wallet> findById(String walletId);

    void save(Wallet wallet);
}
