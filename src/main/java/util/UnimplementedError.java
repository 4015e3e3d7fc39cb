package util;

public class UnimplementedError extends Error {
}
