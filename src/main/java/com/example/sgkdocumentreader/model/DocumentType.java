package com.example.sgkdocumentreader.model;

public enum DocumentType {
    BATTERY_PRESCRIPTION("pil_recete", "Pil Reçetesi", "Pil_Recete"),
    DEVICE_PRESCRIPTION("cihaz_recete", "Cihaz Reçetesi", "Cihaz_Recete"),
    PRESCRIPTION("recete", "Reçete", "Recete"),
    AUDIOMETRY_REPORT("odyogram", "Odyogram", "Odyometri"),
    ELIGIBILITY_CERTIFICATE("uygunluk_belgesi", "Uygunluk Belgesi", "Uygunluk_Raporu"),
    MEDICAL_REPORT("sgk_raporu", "SGK Raporu", "Muayene_Raporu"),
    IDENTITY_CARD("kimlik", "Kimlik Belgesi", "Kimlik"),
    OTHER("diger", "Diğer Belge", "Belge");

    private final String code;
    private final String label;
    private final String fileLabel;

    DocumentType(String code, String label, String fileLabel) {
        this.code = code;
        this.label = label;
        this.fileLabel = fileLabel;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public String fileLabel() {
        return fileLabel;
    }
}
