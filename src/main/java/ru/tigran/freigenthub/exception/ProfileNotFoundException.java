package ru.tigran.freigenthub.exception;

import lombok.Getter;

/**
 * No profile is stored for the user.
 * Fatal for the base user of a search run; peers without profiles are skipped instead.
 */
@Getter
public class ProfileNotFoundException extends ResourceNotFoundException {

    private final String userId;

    public ProfileNotFoundException(String userId) {
        super("No profile stored for user_id '" + userId + "'. Save a profile for this user first.",
                ErrorCode.PROFILE_NOT_FOUND.getCode());
        this.userId = userId;
    }
}
