package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.WalletRole;

public class NoEligibleWalletException extends WalletUnavailableException {

    public NoEligibleWalletException(WalletRole role, String message) {
        super(role, message);
    }
}
