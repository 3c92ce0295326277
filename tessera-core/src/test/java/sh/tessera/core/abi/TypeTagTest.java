// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.error.AbiException;

class TypeTagTest {

    @Test
    void parsesCanonicalNames() {
        assertEquals(TypeTag.ADDRESS, TypeTag.parse("address"));
        assertEquals(new TypeTag.UIntTag(8), TypeTag.parse("uint8"));
        assertEquals(new TypeTag.IntTag(128), TypeTag.parse("int128"));
        assertEquals(TypeTag.BOOL, TypeTag.parse("bool"));
        assertEquals(TypeTag.STRING, TypeTag.parse("string"));
        assertEquals(TypeTag.BYTES, TypeTag.parse("bytes"));
        assertEquals(new TypeTag.ArrayTag(TypeTag.UINT256), TypeTag.parse("uint256[]"));
        assertEquals(new TypeTag.ArrayTag(new TypeTag.ArrayTag(TypeTag.ADDRESS)), TypeTag.parse("address[][]"));
    }

    @Test
    void bareIntegerNamesAreAliasesFor256Bits() {
        assertEquals("uint256", TypeTag.parse("uint").typeName());
        assertEquals("int256", TypeTag.parse("int").typeName());
    }

    @ParameterizedTest
    @ValueSource(strings = {"bytes32", "fixed", "ufixed128x18", "uint7", "uint0", "uint264", "uint08",
            "(uint256,bool)", "uint256[2]", "function", ""})
    void rejectsUnsupportedTypes(String name) {
        AbiEncodingException ex = assertThrows(AbiEncodingException.class, () -> TypeTag.parse(name));
        assertEquals(AbiException.Kind.UNSUPPORTED_TYPE, ex.kind());
    }

    @Test
    void classifiesStaticAndDynamic() {
        assertFalse(TypeTag.ADDRESS.isDynamic());
        assertFalse(TypeTag.UINT256.isDynamic());
        assertFalse(TypeTag.INT256.isDynamic());
        assertFalse(TypeTag.BOOL.isDynamic());
        assertTrue(TypeTag.STRING.isDynamic());
        assertTrue(TypeTag.BYTES.isDynamic());
        assertTrue(new TypeTag.ArrayTag(TypeTag.UINT256).isDynamic());
        assertTrue(AbiEncoder.isDynamic(TypeTag.parse("bool[]")));
    }

    @Test
    void integerWidthMustBeByteMultipleUpTo256() {
        assertThrows(IllegalArgumentException.class, () -> new TypeTag.UIntTag(12));
        assertThrows(IllegalArgumentException.class, () -> new TypeTag.IntTag(264));
        assertThrows(IllegalArgumentException.class, () -> new TypeTag.UIntTag(0));
    }

    @Test
    void arrayTypeNameNestsElementName() {
        assertEquals("string[]", new TypeTag.ArrayTag(TypeTag.STRING).typeName());
        assertEquals(TypeKind.ARRAY, TypeTag.parse("int8[]").kind());
    }
}
