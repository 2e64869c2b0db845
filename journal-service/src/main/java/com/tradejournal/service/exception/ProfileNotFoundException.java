package com.tradejournal.service.exception;

import com.tradejournal.core.exception.JournalException;

public class ProfileNotFoundException extends JournalException {

    public ProfileNotFoundException(String profileId) {
        super("Profile not found: " + profileId);
    }
}
