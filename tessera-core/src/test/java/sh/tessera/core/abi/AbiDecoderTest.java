// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.tessera.core.error.AbiDecodingException;
import sh.tessera.core.error.AbiException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;

class AbiDecoderTest {

    private static final String OWNER = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";

    @Test
    void roundTripsSupportedTypes() {
        List<Param> params = List.of(
                Param.of("owner", "address"),
                Param.of("balance", "uint256"),
                Param.of("active", "bool"),
                Param.of("label", "string"),
                Param.of("small", "uint8"));
        List<AbiValue> values = List.of(
                AbiValue.address(OWNER),
                AbiValue.uint(BigInteger.TEN.pow(30)),
                AbiValue.bool(true),
                AbiValue.string("Tessera ✓"),
                AbiValue.uint(200));

        byte[] encoded = AbiEncoder.encodeArguments(params, values);
        List<TypeTag> types = params.stream().map(Param::type).toList();

        assertEquals(values, AbiDecoder.decodeResult(types, encoded));
    }

    @Test
    void decodesEmptyString() {
        byte[] encoded = AbiEncoder.encodeArguments(List.of(Param.of("s", "string")), List.of(AbiValue.string("")));
        assertEquals(List.of(AbiValue.string("")), AbiDecoder.decodeResult(List.of(TypeTag.STRING), encoded));
    }

    @Test
    void boolIsTrueForAnyNonZeroLastByte() {
        byte[] word = new byte[32];
        word[31] = 2;
        assertEquals(AbiValue.bool(true), AbiDecoder.decodeValue(TypeTag.BOOL, word, 0));
    }

    @Test
    void addressIgnoresLeadingBytes() {
        byte[] word = new byte[32];
        word[0] = 0x7f;
        word[31] = 0x01;
        AbiValue.AddressValue value = (AbiValue.AddressValue) AbiDecoder.decodeValue(TypeTag.ADDRESS, word, 0);
        assertEquals(new Address("0x0000000000000000000000000000000000000001"), value.toAddress());
    }

    @Test
    void rejectsEmptyData() {
        AbiDecodingException ex = assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeResult(List.of(TypeTag.UINT256), new byte[0]));
        assertEquals(AbiException.Kind.EMPTY_DATA, ex.kind());

        AbiDecodingException hex = assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeResult(List.of(TypeTag.UINT256), HexData.EMPTY));
        assertEquals(AbiException.Kind.EMPTY_DATA, hex.kind());
    }

    @Test
    void rejectsDataShorterThanHead() {
        AbiDecodingException ex = assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeResult(List.of(TypeTag.UINT256, TypeTag.UINT256), new byte[40]));
        assertEquals(AbiException.Kind.TRUNCATED_DATA, ex.kind());
    }

    @Test
    void rejectsStringOffsetPastEnd() {
        byte[] data = new byte[32];
        data[30] = 0x10; // offset 4096
        AbiDecodingException ex = assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeResult(List.of(TypeTag.STRING), data));
        assertEquals(AbiException.Kind.TRUNCATED_DATA, ex.kind());
    }

    @Test
    void rejectsHugeStringOffset() {
        byte[] data = new byte[64];
        Arrays.fill(data, 0, 32, (byte) 0xFF);
        AbiDecodingException ex = assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeResult(List.of(TypeTag.STRING), data));
        assertEquals(AbiException.Kind.TRUNCATED_DATA, ex.kind());
    }

    @Test
    void rejectsStringLengthPastEnd() {
        byte[] data = new byte[96];
        data[31] = 0x20;  // offset 32
        data[63] = 0x40;  // length 64, only 32 bytes follow
        AbiDecodingException ex = assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeResult(List.of(TypeTag.STRING), data));
        assertEquals(AbiException.Kind.TRUNCATED_DATA, ex.kind());
    }

    @Test
    void rejectsTypesOutsideDecodeCoverage() {
        byte[] word = new byte[32];
        for (TypeTag type : List.of(TypeTag.INT256, TypeTag.BYTES, TypeTag.parse("uint256[]"))) {
            AbiDecodingException ex = assertThrows(AbiDecodingException.class,
                    () -> AbiDecoder.decodeResult(List.of(type), word));
            assertEquals(AbiException.Kind.UNSUPPORTED_TYPE, ex.kind());
        }
    }

    @Test
    void decodeValueReadsAtHeadOffset() {
        byte[] encoded = AbiEncoder.encodeArguments(
                List.of(Param.of("a", "uint256"), Param.of("b", "uint256")),
                List.of(AbiValue.uint(1), AbiValue.uint(99)));
        assertEquals(AbiValue.uint(99), AbiDecoder.decodeValue(TypeTag.UINT256, encoded, 32));
    }
}
