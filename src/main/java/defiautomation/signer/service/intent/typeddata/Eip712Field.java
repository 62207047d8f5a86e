package defiautomation.signer.service.intent.typeddata;

public record Eip712Field(String name, String type) {

    public Eip712Field {
        if (name == null || name.isBlank() || type == null || type.isBlank()) {
            throw new IllegalArgumentException("Field name and type are required");
        }
    }

    @Override
    public String toString() {
        return type + " " + name;
    }
}
