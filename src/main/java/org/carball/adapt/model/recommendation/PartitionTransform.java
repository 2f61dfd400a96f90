package org.carball.adapt.model.recommendation;

/**
 * The partitioning function applied to a column, rendered as
 * {@code days(col)}, {@code months(col)}, {@code years(col)},
 * {@code bucket(col, N)} or {@code identity(col)}.
 */
public record PartitionTransform(TransformType type, String column, Integer bucketCount) {

    public PartitionTransform {
        if (type == TransformType.BUCKET && (bucketCount == null || bucketCount <= 0)) {
            throw new IllegalArgumentException("Bucket transform requires a positive bucket count");
        }
        if (type != TransformType.BUCKET) {
            bucketCount = null;
        }
    }

    public static PartitionTransform days(String column) {
        return new PartitionTransform(TransformType.DAYS, column, null);
    }

    public static PartitionTransform months(String column) {
        return new PartitionTransform(TransformType.MONTHS, column, null);
    }

    public static PartitionTransform years(String column) {
        return new PartitionTransform(TransformType.YEARS, column, null);
    }

    public static PartitionTransform bucket(String column, int bucketCount) {
        return new PartitionTransform(TransformType.BUCKET, column, bucketCount);
    }

    public static PartitionTransform identity(String column) {
        return new PartitionTransform(TransformType.IDENTITY, column, null);
    }

    public String expression() {
        if (type == TransformType.BUCKET) {
            return String.format("bucket(%s, %d)", column, bucketCount);
        }
        return type.getFunctionName() + "(" + column + ")";
    }

    @Override
    public String toString() {
        return expression();
    }
}
