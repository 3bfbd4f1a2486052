package za.ac.salt.saltuser.models.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * User settings which grant a role when their value is a positive integer.
 */
@Getter
@RequiredArgsConstructor
public enum RoleSetting {
    RIGHT_ADMIN("RightAdmin"),
    RIGHT_BOARD("RightBoard");

    /**
     * the {@code PiptSetting_Name} of the setting
     */
    private final String settingName;
}
