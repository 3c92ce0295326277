// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import sh.tessera.core.error.AbiSignatureException;
import sh.tessera.primitives.Hex;

/**
 * A function name with its ordered parameters.
 *
 * <pre>{@code
 * FunctionSignature sig = FunctionSignature.parse("transfer(address,uint256)");
 * sig.selectorHex(); // 0xa9059cbb
 * }</pre>
 *
 * @param name the function name
 * @param params the parameters, in order
 * @since 0.1.0
 */
public record FunctionSignature(String name, List<Param> params) {

    private static final Pattern SIGNATURE = Pattern.compile("^(\\w+)\\((.*)\\)$");
    private static final Pattern NAME = Pattern.compile("^\\w+$");

    public FunctionSignature {
        Objects.requireNonNull(name, "name");
        if (!NAME.matcher(name).matches()) {
            throw new AbiSignatureException("invalid function name: '" + name + "'");
        }
        params = List.copyOf(params);
    }

    /**
     * Parses {@code name(type1,type2,...)}. Whitespace around type names is ignored;
     * parameters are named {@code param0}, {@code param1}, ...
     *
     * @param signature the signature text
     * @return the parsed signature
     * @throws AbiSignatureException if the text is not of the expected shape
     * @throws sh.tessera.core.error.AbiEncodingException if a type is not supported
     */
    public static FunctionSignature parse(final String signature) {
        Objects.requireNonNull(signature, "signature");
        final Matcher m = SIGNATURE.matcher(signature.trim());
        if (!m.matches()) {
            throw new AbiSignatureException("invalid function signature: '" + signature + "'");
        }
        final String body = m.group(2).trim();
        final List<Param> params = new ArrayList<>();
        if (!body.isEmpty()) {
            final String[] types = body.split(",", -1);
            for (int i = 0; i < types.length; i++) {
                final String type = types[i].trim();
                if (type.isEmpty()) {
                    throw new AbiSignatureException(
                            "empty parameter type at position " + i + " in '" + signature + "'");
                }
                params.add(Param.of("param" + i, type));
            }
        }
        return new FunctionSignature(m.group(1), params);
    }

    public static FunctionSignature of(final String name, final List<Param> params) {
        return new FunctionSignature(name, params);
    }

    public static FunctionSignature of(final String name, final Param... params) {
        return new FunctionSignature(name, List.of(params));
    }

    /**
     * Returns {@code name(t1,t2,...)} with canonical type names and no spaces.
     *
     * @return the canonical signature
     */
    public String canonical() {
        return params.stream()
                .map(p -> p.type().typeName())
                .collect(Collectors.joining(",", name + "(", ")"));
    }

    public byte[] selector() {
        return AbiEncoder.selector(canonical());
    }

    public String selectorHex() {
        return Hex.encode(selector());
    }

    public List<TypeTag> types() {
        return params.stream().map(Param::type).toList();
    }

    @Override
    public String toString() {
        return canonical();
    }
}
