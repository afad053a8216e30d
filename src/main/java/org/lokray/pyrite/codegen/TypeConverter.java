package org.lokray.pyrite.codegen;

import org.lokray.pyrite.expression.SourceTypeKind;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps C++ type spellings and cast targets onto their Python counterparts.
 */
public class TypeConverter
{
	private static final Map<String, String> PRIMITIVE_NAMES = new HashMap<>();
	private static final Map<SourceTypeKind, String> CONVERSIONS = new EnumMap<>(SourceTypeKind.class);

	static
	{
		PRIMITIVE_NAMES.put("unsigned", "int");
		PRIMITIVE_NAMES.put("unsigned byte", "int");
		PRIMITIVE_NAMES.put("unsigned short", "int");
		PRIMITIVE_NAMES.put("unsigned int", "int");
		PRIMITIVE_NAMES.put("unsigned long", "int");
		PRIMITIVE_NAMES.put("unsigned long long", "int");
		PRIMITIVE_NAMES.put("byte", "int");
		PRIMITIVE_NAMES.put("short", "int");
		PRIMITIVE_NAMES.put("long", "int");
		PRIMITIVE_NAMES.put("long long", "int");
		PRIMITIVE_NAMES.put("double", "float");

		CONVERSIONS.put(SourceTypeKind.BOOL, "bool");

		for (SourceTypeKind kind : new SourceTypeKind[]{
				SourceTypeKind.CHAR_U, SourceTypeKind.UCHAR, SourceTypeKind.CHAR16, SourceTypeKind.CHAR32,
				SourceTypeKind.CHAR_S, SourceTypeKind.SCHAR, SourceTypeKind.WCHAR})
		{
			CONVERSIONS.put(kind, "str");
		}

		for (SourceTypeKind kind : new SourceTypeKind[]{
				SourceTypeKind.USHORT, SourceTypeKind.UINT, SourceTypeKind.ULONG, SourceTypeKind.ULONGLONG,
				SourceTypeKind.UINT128, SourceTypeKind.SHORT, SourceTypeKind.INT, SourceTypeKind.LONG,
				SourceTypeKind.LONGLONG, SourceTypeKind.INT128})
		{
			CONVERSIONS.put(kind, "int");
		}

		for (SourceTypeKind kind : new SourceTypeKind[]{
				SourceTypeKind.FLOAT, SourceTypeKind.DOUBLE, SourceTypeKind.LONGDOUBLE})
		{
			CONVERSIONS.put(kind, "float");
		}
	}

	/**
	 * Returns the Python name for a C++ primitive spelling, or the spelling
	 * itself when it has no entry.
	 */
	public static String toPythonPrimitive(String cTypeName)
	{
		return PRIMITIVE_NAMES.getOrDefault(cTypeName, cTypeName);
	}

	/**
	 * Returns the Python conversion function a cast to {@code kind} turns into.
	 * Empty means the value passes through as it is.
	 */
	public static Optional<String> conversionFor(SourceTypeKind kind)
	{
		return Optional.ofNullable(CONVERSIONS.get(kind));
	}
}
