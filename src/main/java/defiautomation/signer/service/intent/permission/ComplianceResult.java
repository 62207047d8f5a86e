package defiautomation.signer.service.intent.permission;

public record ComplianceResult(boolean allowed, String reason, Code errorCode) {

    public enum Code {
        CURRENCY_NOT_ALLOWED,
        EFFECT_NOT_ALLOWED
    }

    public static ComplianceResult allow() {
        return new ComplianceResult(true, null, null);
    }

    public static ComplianceResult deny(Code code, String reason) {
        return new ComplianceResult(false, reason, code);
    }
}
