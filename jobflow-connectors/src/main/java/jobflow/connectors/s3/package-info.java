/**
 * Amazon S3 delivery through the AWS SDK v2 {@link software.amazon.awssdk.services.s3.S3Client}.
 */
package jobflow.connectors.s3;
