package com.contrastsecurity.appsource.constants;

/**
 * Privacy usage categories an app can declare.
 *
 * Not exhaustive, this is the common set apps request. Names are the Info.plist key
 * with the {@code NS} prefix and {@code UsageDescription} suffix removed.
 */
public enum PrivacyCategory {
    BLUETOOTH_ALWAYS("BluetoothAlways"),
    BLUETOOTH_PERIPHERAL("BluetoothPeripheral"),
    CALENDARS("Calendars"),
    REMINDERS("Reminders"),
    CAMERA("Camera"),
    MICROPHONE("Microphone"),
    CONTACTS("Contacts"),
    FACE_ID("FaceID"),
    DESKTOP_FOLDER("DesktopFolder"),
    DOCUMENTS_FOLDER("DocumentsFolder"),
    DOWNLOADS_FOLDER("DownloadsFolder"),
    NETWORK_VOLUMES("NetworkVolumes"),
    REMOVABLE_VOLUMES("RemovableVolumes"),
    FILE_PROVIDER_DOMAIN("FileProviderDomain"),
    GK_FRIEND_LIST("GKFriendList"),
    HEALTH_CLINICAL_HEALTH_RECORDS_SHARE("HealthClinicalHealthRecordsShare"),
    HEALTH_SHARE("HealthShare"),
    HEALTH_UPDATE("HealthUpdate"),
    HOME_KIT("HomeKit"),
    LOCATION_ALWAYS_AND_WHEN_IN_USE("LocationAlwaysAndWhenInUse"),
    LOCATION("Location"),
    LOCATION_WHEN_IN_USE("LocationWhenInUse"),
    LOCATION_ALWAYS("LocationAlways"),
    APPLE_MUSIC("AppleMusic"),
    MOTION("Motion"),
    FALL_DETECTION("FallDetection"),
    LOCAL_NETWORK("LocalNetwork"),
    NEARBY_INTERACTION("NearbyInteraction"),
    NEARBY_INTERACTION_ALLOW_ONCE("NearbyInteractionAllowOnce"),
    NFC_READER("NFCReader"),
    PHOTO_LIBRARY_ADD("PhotoLibraryAdd"),
    PHOTO_LIBRARY("PhotoLibrary"),
    USER_TRACKING("UserTracking"),
    APPLE_EVENTS("AppleEvents"),
    SYSTEM_ADMINISTRATION("SystemAdministration"),
    SENSOR_KIT("SensorKit"),
    SIRI("Siri"),
    SPEECH_RECOGNITION("SpeechRecognition"),
    VIDEO_SUBSCRIBER_ACCOUNT("VideoSubscriberAccount"),
    IDENTITY("Identity");

    private final String value;

    PrivacyCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get PrivacyCategory from its catalog name.
     *
     * @param value catalog name, matched exactly
     * @return PrivacyCategory enum or null if not found
     */
    public static PrivacyCategory fromString(String value) {
        if (value == null) {
            return null;
        }
        for (PrivacyCategory category : values()) {
            if (category.value.equals(value)) {
                return category;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
