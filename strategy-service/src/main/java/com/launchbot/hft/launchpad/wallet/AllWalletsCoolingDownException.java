package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.WalletRole;

/**
 * Wallets of the role would otherwise qualify, but every one of them is cooling down.
 */
public class AllWalletsCoolingDownException extends WalletUnavailableException {

    public AllWalletsCoolingDownException(WalletRole role, String message) {
        super(role, message);
    }
}
