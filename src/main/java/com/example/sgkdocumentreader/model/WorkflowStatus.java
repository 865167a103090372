package com.example.sgkdocumentreader.model;

/**
 * SGK reimbursement workflow of a patient, in the order it is normally walked.
 */
public enum WorkflowStatus {
    INQUIRY_STARTED("Sorgulama Başlatıldı", "SGK sorgusu yapıldı"),
    PRESCRIPTION_SAVED("Reçete Kaydedildi", "Reçete sisteme kaydedildi"),
    MATERIALS_DELIVERED("Malzemeler Teslim Edildi", "Cihaz/malzeme hastaya teslim edildi"),
    DOCUMENTS_UPLOADED("Belgeler Yüklendi", "Gerekli belgeler sisteme yüklendi"),
    INVOICED("Faturalandı", "Fatura kesildi ve gönderildi"),
    PAYMENT_RECEIVED("Ödeme Alındı", "Ödeme tamamlandı");

    private final String label;
    private final String description;

    WorkflowStatus(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public boolean isAfter(WorkflowStatus other) {
        return other == null || ordinal() > other.ordinal();
    }
}
