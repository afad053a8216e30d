package org.lokray.pyrite.expression;

/**
 * The C++ type families a static cast can target, as reported by the front-end.
 */
public enum SourceTypeKind
{
	BOOL,

	CHAR_U,
	UCHAR,
	CHAR16,
	CHAR32,
	CHAR_S,
	SCHAR,
	WCHAR,

	USHORT,
	UINT,
	ULONG,
	ULONGLONG,
	UINT128,
	SHORT,
	INT,
	LONG,
	LONGLONG,
	INT128,

	FLOAT,
	DOUBLE,
	LONGDOUBLE,

	VOID,
	POINTER,
	LVALUE_REFERENCE,
	RECORD,
	ENUM,
	TYPEDEF,
	ELABORATED,
	CONSTANT_ARRAY,
	UNEXPOSED
}
