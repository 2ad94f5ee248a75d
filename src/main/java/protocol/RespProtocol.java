package protocol;

import org.apache.commons.io.IOUtils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis RESP 프로토콜 파싱 및 응답 생성을 담당하는 클래스
 */
public class RespProtocol {

    public static final String PONG_RESPONSE = "+PONG\r\n";
    public static final String OK_RESPONSE = "+OK\r\n";
    public static final String NULL_BULK_STRING = "$-1\r\n";

    private static final byte[] CRLF = {'\r', '\n'};

    // 512MB, Redis의 proto-max-bulk-len 기본값
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_HEADER_LENGTH = 64;
    static final int MAX_NESTING_DEPTH = 128;

    private RespProtocol() {
    }

    /**
     * 스트림에서 최상위 RESP 값 하나를 읽습니다.
     *
     * @param in 버퍼링된 입력 스트림 (헤더는 한 바이트씩 읽습니다)
     * @return 디코딩된 값, 새 값을 시작하기 전에 스트림이 끝났으면 {@code null}
     * @throws RespDecodeException 입력이 잘못되었거나 값 도중에 스트림이 끝난 경우
     * @throws IOException 하위 스트림 읽기 실패
     */
    public static RespValue decode(InputStream in) throws IOException {
        int type = in.read();
        if (type == -1) {
            return null;
        }
        return decodeValue(in, type, 0);
    }

    private static RespValue decodeValue(InputStream in, int type, int depth) throws IOException {
        switch (type) {
            case '*':
                return decodeArray(in, depth);
            case '$':
                return decodeBulkString(in);
            default:
                throw new RespDecodeException("unrecognized type marker: 0x" + Integer.toHexString(type & 0xFF));
        }
    }

    private static RespArray decodeArray(InputStream in, int depth) throws IOException {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new RespDecodeException("array nesting exceeds " + MAX_NESTING_DEPTH + " levels");
        }
        int count = readLength(in, "array");

        List<RespValue> elements = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int type = in.read();
            if (type == -1) {
                throw new RespDecodeException("stream ended after " + i + " of " + count + " array elements");
            }
            elements.add(decodeValue(in, type, depth + 1));
        }
        return new RespArray(elements);
    }

    private static BulkString decodeBulkString(InputStream in) throws IOException {
        int length = readLength(in, "bulk string");
        if (length > MAX_BULK_LENGTH) {
            throw new RespDecodeException("bulk string length " + length + " exceeds " + MAX_BULK_LENGTH);
        }

        // 선언된 길이만큼 미리 할당하지 않고, 실제로 도착한 만큼만 버퍼가 커집니다
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        long copied = IOUtils.copyLarge(in, content, 0, length);
        if (copied < length) {
            throw new RespDecodeException("truncated bulk string, expected " + length + " bytes but got " + copied);
        }

        try {
            // 종료 CRLF는 값 검증 없이 버립니다
            IOUtils.skipFully(in, CRLF.length);
        } catch (EOFException e) {
            throw new RespDecodeException("truncated bulk string, missing trailing CRLF", e);
        }
        return new BulkString(content.toByteArray());
    }

    /**
     * 타입 바이트 다음의 길이 헤더 줄을 읽어 음이 아닌 정수로 반환합니다.
     */
    private static int readLength(InputStream in, String what) throws IOException {
        String header = readLine(in);
        try {
            int length = Integer.parseInt(header);
            if (length < 0) {
                throw new RespDecodeException("negative " + what + " length: " + length);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new RespDecodeException("invalid " + what + " length header: '" + header + "'", e);
        }
    }

    /**
     * 입력 스트림에서 LF까지 한 줄을 읽습니다. 끝의 CR은 제거됩니다.
     * 앞에 붙은 0은 길이 제한에 포함되지 않도록 하나만 남기고 버립니다.
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        int first = -1;
        int b;
        while ((b = in.read()) != '\n') {
            if (b == -1) {
                throw new RespDecodeException("stream ended inside a header line");
            }
            if (bos.size() == 1 && first == '0' && b >= '0' && b <= '9') {
                bos.reset();
            }
            if (bos.size() >= MAX_HEADER_LENGTH) {
                throw new RespDecodeException("header line longer than " + MAX_HEADER_LENGTH + " bytes");
            }
            if (bos.size() == 0) {
                first = b;
            }
            bos.write(b);
        }
        String line = bos.toString(StandardCharsets.US_ASCII);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * 응답을 와이어 바이트로 인코딩합니다. 저장소 상태와 무관한 순수 함수입니다.
     */
    public static byte[] encode(Reply reply) {
        switch (reply.getType()) {
            case STATUS:
                return createSimpleString(new String(reply.payload(), StandardCharsets.UTF_8));
            case BULK:
                return createBulkString(reply.payload());
            case NULL:
                return createNullBulkString();
            default:
                throw new IllegalArgumentException("unsupported reply type: " + reply.getType());
        }
    }

    /**
     * RESP bulk string 형식으로 바이트를 인코딩합니다. 길이는 바이트 단위입니다.
     */
    public static byte[] createBulkString(byte[] content) {
        byte[] header = ("$" + content.length + "\r\n").getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream bos = new ByteArrayOutputStream(header.length + content.length + CRLF.length);
        bos.writeBytes(header);
        bos.writeBytes(content);
        bos.writeBytes(CRLF);
        return bos.toByteArray();
    }

    /**
     * 단순 문자열 응답을 RESP 형식으로 생성합니다.
     */
    public static byte[] createSimpleString(String value) {
        return ("+" + value + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] createNullBulkString() {
        return NULL_BULK_STRING.getBytes(StandardCharsets.US_ASCII);
    }
}
