package defiautomation.signer.service.intent.typeddata;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.web3j.crypto.Hash;

/**
 * A named EIP-712 struct with its member fields and the struct types those
 * fields reference.
 */
public final class Eip712StructType {

    private final String name;
    private final List<Eip712Field> fields;
    private final List<Eip712StructType> dependencies;
    private final String encodedType;
    private final byte[] typeHash;

    public Eip712StructType(String name, List<Eip712Field> fields, List<Eip712StructType> dependencies) {
        this.name = name;
        this.fields = List.copyOf(fields);
        this.dependencies = List.copyOf(dependencies);
        this.encodedType = buildEncodedType();
        this.typeHash = Hash.sha3(encodedType.getBytes(StandardCharsets.UTF_8));
    }

    public Eip712StructType(String name, List<Eip712Field> fields) {
        this(name, fields, List.of());
    }

    /**
     * Parses a canonical signature such as {@code Mail(address to,string contents)}.
     */
    public static Eip712StructType parse(String signature, Eip712StructType... dependencies) {
        int open = signature.indexOf('(');
        if (open <= 0 || !signature.endsWith(")")) {
            throw new IllegalArgumentException("Malformed struct signature: " + signature);
        }
        String body = signature.substring(open + 1, signature.length() - 1);
        List<Eip712Field> fields = new ArrayList<>();
        if (!body.isBlank()) {
            for (String member : body.split(",")) {
                String[] parts = member.trim().split(" ");
                if (parts.length != 2) {
                    throw new IllegalArgumentException("Malformed struct member: " + member);
                }
                fields.add(new Eip712Field(parts[1], parts[0]));
            }
        }
        return new Eip712StructType(signature.substring(0, open), fields, List.of(dependencies));
    }

    public String getName() {
        return name;
    }

    public List<Eip712Field> getFields() {
        return fields;
    }

    /**
     * Own signature only, without referenced types.
     */
    public String signature() {
        return name + "(" + fields.stream().map(Eip712Field::toString).collect(Collectors.joining(",")) + ")";
    }

    /**
     * {@code encodeType}: this struct followed by every referenced struct, sorted by name.
     */
    public String encodeType() {
        return encodedType;
    }

    public byte[] typeHash() {
        return typeHash.clone();
    }

    /**
     * Finds a referenced struct type, searching transitively.
     */
    public Optional<Eip712StructType> dependency(String typeName) {
        Map<String, Eip712StructType> all = new TreeMap<>();
        collect(this, all);
        all.remove(name);
        return Optional.ofNullable(all.get(typeName));
    }

    private String buildEncodedType() {
        Map<String, Eip712StructType> referenced = new TreeMap<>();
        collect(this, referenced);
        referenced.remove(name);
        StringBuilder sb = new StringBuilder(signature());
        referenced.values().forEach(type -> sb.append(type.signature()));
        return sb.toString();
    }

    private static void collect(Eip712StructType type, Map<String, Eip712StructType> into) {
        if (into.putIfAbsent(type.name, type) != null) {
            return;
        }
        for (Eip712StructType dependency : type.dependencies) {
            collect(dependency, into);
        }
    }

    @Override
    public String toString() {
        return encodedType;
    }
}
