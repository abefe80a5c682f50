package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.Wallet;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryWalletStore implements WalletStore {

    private final Map<String, Wallet> wallets = new ConcurrentHashMap<>();

    public InMemoryWalletStore(List<Wallet> initial) {
        initial.forEach(this::save);
    }

    @Override
    public List<Wallet> findAll() {
        return wallets.values().stream()
                .sorted(Comparator.comparing(Wallet::id))
                .toList();
    }

    @Override
    public Optional<Wallet> findById(String walletId) {
        return Optional.ofNullable(wallets.get(walletId));
    }

    @Override
    public void save(Wallet wallet) {
        wallets.put(wallet.id(), wallet);
    }
}
