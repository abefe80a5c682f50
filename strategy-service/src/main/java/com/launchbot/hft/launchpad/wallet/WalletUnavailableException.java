package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.WalletRole;

/**
 * No wallet of the requested role can take the trade right now. Callers fall back to another role or defer.
 */
public class WalletUnavailableException extends Exception {

    private final WalletRole role;

    public WalletUnavailableException(WalletRole role, String message) {
        super(message);
        this.role = role;
    }

    public WalletRole role() {
        return role;
    }
}
